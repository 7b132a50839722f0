// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Conduit nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit;

import com.starlight.conduit.driver.RoutingIdentity;
import com.starlight.conduit.exception.DispatchException;

import javax.annotation.Nullable;


/**
 * Server-side target for calls to the factory object. One is made per call so the
 * calling peer can be recorded as the owner of anything it creates.
 */
class FactoryService implements RemoteFactory {
	private static final Object[] NO_ARGS = new Object[ 0 ];

	private final ObjectRegistry registry;
	private final RoutingIdentity caller;


	FactoryService( ObjectRegistry registry, @Nullable RoutingIdentity caller ) {
		this.registry = registry;
		this.caller = caller;
	}


	@Override
	public int create( String type_name, Object[] args ) {
		if ( type_name == null ) throw new NullPointerException( "Null type name" );

		try {
			return registry.create( type_name, args == null ? NO_ARGS : args, caller );
		}
		catch( DispatchException ex ) {
			throw new DispatchFailure( ex );
		}
	}


	@Override
	public void destroy( int object_id ) {
		try {
			registry.destroy( object_id );
		}
		catch( DispatchException ex ) {
			throw new DispatchFailure( ex );
		}
	}
}
